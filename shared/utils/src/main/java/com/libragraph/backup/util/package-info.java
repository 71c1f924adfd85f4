/**
 * Shared utilities for all backup modules.
 *
 * <p>Contains {@link com.libragraph.backup.util.DateProvider} (the injectable clock used by
 * the retention policy) and {@link com.libragraph.backup.util.ExpirationTimes}.
 * No framework dependencies, pure Java.
 */
package com.libragraph.backup.util;
