/**
 * The backup record model: one {@link com.libragraph.backup.frames.Frame} per record
 * appended to the backup stream.
 *
 * <p>All records are immutable and validated on construction, so a frame that exists
 * is a frame that can be written. Serialization lives in
 * {@code com.libragraph.backup.frames.stream}.
 */
package com.libragraph.backup.frames;
