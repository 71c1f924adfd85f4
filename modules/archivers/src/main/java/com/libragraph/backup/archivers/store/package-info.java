/**
 * Storage seams used by the archivers. Implementations live in the core module;
 * tests substitute in-memory fakes.
 */
package com.libragraph.backup.archivers.store;
