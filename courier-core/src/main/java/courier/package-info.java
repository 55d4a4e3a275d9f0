/**
 * Background task dispatch: envelopes, handlers, outcomes and the caller-side dispatcher.
 *
 * @see courier.Courier
 * @see courier.TaskDispatcher
 * @see courier.worker.WorkerPool
 */
package courier;
