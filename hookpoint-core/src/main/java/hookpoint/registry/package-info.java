/**
 * Handler registration keyed by hook name.
 *
 * <p>The registry keeps, for each hook name, the ordered list of
 * {@link hookpoint.Registration registrations}. Order decides result order and which owner wins
 * in merge-based aggregation.
 *
 * @see hookpoint.registry.HookRegistry
 * @see hookpoint.registry.DefaultHookRegistry
 */
package hookpoint.registry;
