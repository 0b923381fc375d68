/**
 * Source readers: CSV and spreadsheet files exposed as a lazy sequence of raw rows.
 */
package io.github.yok.flexload.parser;
