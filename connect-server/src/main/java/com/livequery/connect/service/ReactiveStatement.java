package com.livequery.connect.service;

/**
 * A statement handled by the subscription engine rather than the database.
 */
public interface ReactiveStatement {

    /**
     * @return the command tag reported to the client, e.g. {@code SUBSCRIBE}
     */
    String statementTag();

    /**
     * @return true if the statement streams rows, false if it only acknowledges
     */
    boolean returnsRows();

    /**
     * @return canonical statement text
     */
    String format();
}
