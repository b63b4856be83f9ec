/**
 * Contact form relay.
 */
package com.mimecast.courier.contact;
