/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

/**
 * Thrown by a server when a command could not be sent or its reply could not
 * be read, for example because the connection was closed. Whether the
 * command was applied on the server is unknown.
 */
public class NetworkException extends RetryableException {

    private static final long serialVersionUID = 1L;

    private final String address;

    /**
     * @param address the address of the server, may be null
     * @param msg the message
     */
    public NetworkException(String address, String msg) {
        this(address, msg, null);
    }

    /**
     * @param address the address of the server, may be null
     * @param msg the message
     * @param cause the underlying I/O failure
     */
    public NetworkException(String address, String msg, Throwable cause) {
        super(msg, cause);
        this.address = address;
    }

    /**
     * Returns the address of the server the failure was observed on.
     *
     * @return the address, or null if not known
     */
    public String getAddress() {
        return address;
    }

    @Override
    public String getMessage() {
        if (address == null) {
            return super.getMessage();
        }
        return super.getMessage() + " [server=" + address + "]";
    }
}
