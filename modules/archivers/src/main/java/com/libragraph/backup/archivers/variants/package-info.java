/**
 * The concrete interaction archivers. Predicates are disjoint: incoming and outgoing
 * messages select on type and direction, info messages on directionless chat updates.
 */
package com.libragraph.backup.archivers.variants;
