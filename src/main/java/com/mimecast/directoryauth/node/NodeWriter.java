package com.mimecast.directoryauth.node;

import com.mimecast.directoryauth.exception.AuthException;

/**
 * Records a selected node on the user entry.
 */
@FunctionalInterface
public interface NodeWriter {

    /**
     * Writes the node.
     *
     * @param node Selected node.
     * @return True if the write was acknowledged.
     * @throws AuthException Write failed.
     */
    boolean write(String node) throws AuthException;
}
