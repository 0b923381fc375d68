/**
 * Transform-and-load pipeline: schema resolution, value coercion, bulk insert and the staging
 * table swap.
 */
package io.github.yok.flexload.core;
