/**
 * Fatal error types of a load run.
 *
 * <p>
 * {@link io.github.yok.flexload.exception.SourceReadException} aborts before the database is
 * touched; {@link io.github.yok.flexload.exception.BatchInsertException} and
 * {@link io.github.yok.flexload.exception.TransactionException} abort during the database phases.
 * </p>
 */
package io.github.yok.flexload.exception;
