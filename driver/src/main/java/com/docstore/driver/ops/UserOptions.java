/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.docstore.driver.ReadPreference;
import com.docstore.driver.WriteConcern;

import org.bson.Document;

/**
 * Options for adding and removing users. In addition to the keys recognized
 * by {@link CommandOptions}, {@link #fromDocument} accepts
 * {@code customData} (Document), {@code roles} (a List of role names or
 * role Documents) and {@code dbName} (String).
 */
public class UserOptions extends CommandOptions {

    private Document customData;
    private List<Object> roles;
    private String dbName;

    public UserOptions() {}

    /**
     * Builds options from a document.
     *
     * @param doc the document
     *
     * @return the options
     *
     * @throws IllegalArgumentException if the document contains an
     * unrecognized key or a value of the wrong type
     */
    public static UserOptions fromDocument(Document doc) {
        UserOptions options = new UserOptions();
        options.applyDocument(doc);
        return options;
    }

    @Override
    protected boolean applyOption(String key, Object value) {
        switch (key) {
        case "customData":
            customData = requireType(key, value, Document.class);
            return true;
        case "roles":
            List<?> list = requireType(key, value, List.class);
            List<Object> checked = new ArrayList<Object>(list.size());
            for (Object role : list) {
                checked.add(checkRole(role));
            }
            roles = checked;
            return true;
        case "dbName":
            dbName = requireType(key, value, String.class);
            return true;
        default:
            return super.applyOption(key, value);
        }
    }

    private static Object checkRole(Object role) {
        if (!(role instanceof String) && !(role instanceof Document)) {
            throw new IllegalArgumentException(
                "Each role must be a String or a Document");
        }
        return role;
    }

    /**
     * Sets custom data stored with the user.
     *
     * @param customData the data
     *
     * @return this
     */
    public UserOptions setCustomData(Document customData) {
        this.customData = customData;
        return this;
    }

    /**
     * @return the custom data, or null if not set
     */
    public Document getCustomData() {
        return customData;
    }

    /**
     * Sets the roles granted to the user. Each role is either a role name
     * or a document naming a role and its database.
     *
     * @param roles the roles
     *
     * @return this
     */
    public UserOptions setRoles(List<?> roles) {
        if (roles == null) {
            this.roles = null;
            return this;
        }
        List<Object> checked = new ArrayList<Object>(roles.size());
        for (Object role : roles) {
            checked.add(checkRole(role));
        }
        this.roles = checked;
        return this;
    }

    /**
     * @return an unmodifiable view of the roles, or null if not set
     */
    public List<Object> getRoles() {
        return roles == null ? null : Collections.unmodifiableList(roles);
    }

    /**
     * Sets the database the user is defined in.
     *
     * @param dbName the database name
     *
     * @return this
     */
    public UserOptions setDbName(String dbName) {
        this.dbName = dbName;
        return this;
    }

    /**
     * @return the database name, or null if not set
     */
    public String getDbName() {
        return dbName;
    }

    @Override
    public UserOptions setWriteConcern(WriteConcern writeConcern) {
        super.setWriteConcern(writeConcern);
        return this;
    }

    @Override
    public UserOptions setMaxTimeMS(int maxTimeMS) {
        super.setMaxTimeMS(maxTimeMS);
        return this;
    }

    @Override
    public UserOptions setReadPreference(ReadPreference readPreference) {
        super.setReadPreference(readPreference);
        return this;
    }

    @Override
    public UserOptions setComment(String comment) {
        super.setComment(comment);
        return this;
    }

    @Override
    public UserOptions copy() {
        UserOptions copy = new UserOptions();
        copyTo(copy);
        copy.customData = customData;
        copy.roles = roles == null ? null : new ArrayList<Object>(roles);
        copy.dbName = dbName;
        return copy;
    }
}
