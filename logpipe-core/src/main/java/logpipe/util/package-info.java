/**
 * Dependency-free JSON encoding of log entries.
 */
package logpipe.util;
