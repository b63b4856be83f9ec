/**
 * Session factory seam and result types.
 *
 * <p>{@link com.mimecast.courier.transport.Outcome}, {@link com.mimecast.courier.transport.SearchResult}
 * <br>and {@link com.mimecast.courier.transport.FetchResult} report best-effort steps and protocol acknowledgements
 * <br>without exceptions.
 */
package com.mimecast.courier.transport;
