/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import org.bson.Document;

/**
 * Options for the validate command. {@link #fromDocument} accepts
 * {@code full}, {@code background} and {@code repair}, all Boolean.
 */
public class ValidateOptions {

    private Boolean full;
    private Boolean background;
    private Boolean repair;

    public ValidateOptions() {}

    /**
     * Builds options from a document.
     *
     * @param doc the document
     *
     * @return the options
     *
     * @throws IllegalArgumentException if the document contains an
     * unrecognized key or a value that is not a Boolean
     */
    public static ValidateOptions fromDocument(Document doc) {
        ValidateOptions options = new ValidateOptions();
        for (String key : doc.keySet()) {
            Boolean value = CommandOptions.requireType(
                key, doc.get(key), Boolean.class);
            switch (key) {
            case "full":
                options.full = value;
                break;
            case "background":
                options.background = value;
                break;
            case "repair":
                options.repair = value;
                break;
            default:
                throw new IllegalArgumentException(
                    "Unrecognized option for ValidateOptions: " + key);
            }
        }
        return options;
    }

    public ValidateOptions setFull(boolean full) {
        this.full = full;
        return this;
    }

    public Boolean getFull() {
        return full;
    }

    public ValidateOptions setBackground(boolean background) {
        this.background = background;
        return this;
    }

    public Boolean getBackground() {
        return background;
    }

    public ValidateOptions setRepair(boolean repair) {
        this.repair = repair;
        return this;
    }

    public Boolean getRepair() {
        return repair;
    }

    /**
     * Appends the options that are set to a validate command.
     *
     * @param command the command
     *
     * @return the command
     */
    public Document appendTo(Document command) {
        if (full != null) {
            command.append("full", full);
        }
        if (background != null) {
            command.append("background", background);
        }
        if (repair != null) {
            command.append("repair", repair);
        }
        return command;
    }

    public ValidateOptions copy() {
        ValidateOptions copy = new ValidateOptions();
        copy.full = full;
        copy.background = background;
        copy.repair = repair;
        return copy;
    }
}
