/**
 * Pure folding functions over the ordered results of a hook invocation.
 *
 * @see hookpoint.aggregate.Aggregators
 */
package hookpoint.aggregate;
