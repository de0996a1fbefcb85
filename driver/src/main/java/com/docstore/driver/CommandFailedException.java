/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.bson.Document;

/**
 * Thrown when a command reached the server but the server reported a
 * failure, either with a reply whose {@code ok} field is not 1 or with a
 * write error. These failures are never retried automatically.
 * <p>
 * Instances built from a server reply carry the reply and the error code,
 * code name and error labels found in it.
 */
public class CommandFailedException extends DocStoreException {

    private static final long serialVersionUID = 1L;

    private final int code;
    private final String codeName;
    private final List<String> errorLabels;
    private final transient Document response;

    /**
     * Creates an exception for a failure detected by the driver while
     * interpreting a reply, without an associated server error code.
     *
     * @param msg the message
     */
    public CommandFailedException(String msg) {
        this(msg, 0, null, Collections.emptyList(), null);
    }

    /**
     * @hidden
     */
    public CommandFailedException(String msg,
                                  int code,
                                  String codeName,
                                  List<String> errorLabels,
                                  Document response) {
        super(msg);
        this.code = code;
        this.codeName = codeName;
        this.errorLabels = errorLabels;
        this.response = response;
    }

    /**
     * Converts a server reply, or a single write error taken from one, into
     * an exception. This is the one conversion used for every command reply
     * whose {@code ok} field is not 1.
     * <p>
     * The message is taken from the first of {@code err}, {@code errmsg} and
     * {@code errMsg} that is present, otherwise the reply itself is used as
     * the message.
     *
     * @param response the reply document
     *
     * @return the exception
     */
    public static CommandFailedException fromResponse(Document response) {
        if (response == null) {
            return new CommandFailedException("Command failed with no reply");
        }
        String msg = firstString(response, "err", "errmsg", "errMsg");
        if (msg == null) {
            msg = response.toJson();
        }
        int code = 0;
        Object codeValue = response.get("code");
        if (codeValue instanceof Number) {
            code = ((Number) codeValue).intValue();
        }
        String codeName = response.get("codeName") instanceof String ?
            response.getString("codeName") : null;

        List<String> labels = new ArrayList<>();
        Object labelValue = response.get("errorLabels");
        if (labelValue instanceof List) {
            for (Object label : (List<?>) labelValue) {
                labels.add(String.valueOf(label));
            }
        }
        return new CommandFailedException(msg, code, codeName,
            Collections.unmodifiableList(labels), response);
    }

    private static String firstString(Document doc, String... fields) {
        for (String field : fields) {
            Object value = doc.get(field);
            if (value instanceof String) {
                return (String) value;
            }
        }
        return null;
    }

    /**
     * Returns the server error code.
     *
     * @return the code, or 0 if the reply carried none
     */
    public int getCode() {
        return code;
    }

    /**
     * Returns the server error code name.
     *
     * @return the code name, or null
     */
    public String getCodeName() {
        return codeName;
    }

    /**
     * Returns the error labels attached to the reply.
     *
     * @return the labels, never null
     */
    public List<String> getErrorLabels() {
        return errorLabels;
    }

    /**
     * Returns true if the reply carried the given error label.
     *
     * @param label the label
     *
     * @return true if present
     */
    public boolean hasErrorLabel(String label) {
        return errorLabels.contains(label);
    }

    /**
     * Returns the reply or write error document this exception was built
     * from.
     *
     * @return the document, or null if the failure was detected by the
     * driver
     */
    public Document getResponse() {
        return response;
    }
}
