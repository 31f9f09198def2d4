// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token.event;

/**
 * Receives {@link TokenEvent}s after each committed operation, in emission order.
 * <p>
 * Called synchronously on the thread that ran the operation. An exception thrown
 * here is logged and does not undo the committed operation.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TokenEventListener {

    /**
     * Handles one event.
     *
     * @param event the committed event
     */
    void onEvent(TokenEvent event);
}
