/**
 * The asynchronous write path: entry queue, batch workers and the transactional batch flusher.
 */
package opsaudit.pipeline;
