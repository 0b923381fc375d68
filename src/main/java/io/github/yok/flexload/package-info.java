/**
 * FlexLoad: loads CSV and Excel files into PostgreSQL tables through a staging table.
 */
package io.github.yok.flexload;
