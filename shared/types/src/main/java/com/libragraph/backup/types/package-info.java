/**
 * Pure Java value types shared across all backup modules.
 *
 * <p>Identifiers ({@link com.libragraph.backup.types.ThreadUniqueId},
 * {@link com.libragraph.backup.types.ChatId}, {@link com.libragraph.backup.types.RecipientId},
 * {@link com.libragraph.backup.types.ChatItemId}) and the enums used by both the local
 * chat model and the backup frames. The in-memory chat model lives in
 * {@code com.libragraph.backup.types.model}.
 * This module has no framework dependencies.
 */
package com.libragraph.backup.types;
