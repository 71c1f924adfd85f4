/**
 * Interaction archivers: one variant per kind of chat record, dispatched in priority
 * order by {@link com.libragraph.backup.archivers.InteractionArchiverRegistry}.
 *
 * <p>The variant contract and its result types are in {@code .api}; the identifier maps
 * for a session in {@code .context}; the storage seams in {@code .store}.
 */
package com.libragraph.backup.archivers;
