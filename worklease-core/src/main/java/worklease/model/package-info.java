/**
 * Unit-of-work model: the persisted row, its lifecycle status, and the pipeline
 * that decides which status changes are legal.
 *
 * @see worklease.model.WorkStatus
 * @see worklease.model.Pipeline
 * @see worklease.model.WorkUnit
 */
package worklease.model;
