/**
 * JDBC support: connection provider, subscription store and the SQL helper shared by the
 * stores. DDL for H2, PostgreSQL and MySQL ships under {@code hookrelay/schema/}.
 */
package hookrelay.jdbc;
