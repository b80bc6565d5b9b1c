/**
 * Node assignment backed by the {@code available_nodes} table.
 */
package com.mimecast.directoryauth.node;
