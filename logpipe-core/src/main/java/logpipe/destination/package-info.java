/**
 * Ready-made {@link logpipe.Destination} implementations.
 */
package logpipe.destination;
