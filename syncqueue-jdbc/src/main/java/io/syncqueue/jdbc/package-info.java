/**
 * JDBC implementations of the queue SPIs for H2, PostgreSQL and MySQL.
 *
 * <p>DDL for each database ships under {@code schema/} on the classpath.
 */
package io.syncqueue.jdbc;
