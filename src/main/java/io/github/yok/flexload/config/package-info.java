/**
 * Application settings and the JSON column configuration.
 */
package io.github.yok.flexload.config;
