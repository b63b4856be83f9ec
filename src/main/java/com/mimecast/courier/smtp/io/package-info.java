/**
 * Stream helpers.
 */
package com.mimecast.courier.smtp.io;
