/**
 * Database access: connections, table names and the SQL dialect.
 */
package io.github.yok.flexload.db;
