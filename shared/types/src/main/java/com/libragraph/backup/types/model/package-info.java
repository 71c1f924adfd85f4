/**
 * In-memory chat records as the local database holds them.
 *
 * <p>Read-only to the archivers; the restore path creates new instances
 * with {@code rowId == 0} and lets the store assign the row id.
 */
package com.libragraph.backup.types.model;
