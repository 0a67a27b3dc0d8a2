package com.regiongraph.api;

/**
 * Observability interface for the network initialization driver.
 *
 * Callbacks arrive on the thread that called initialize(), in order:
 * any number of onPassStart/onPassEnd pairs, then either onInitialized or
 * onFailure.
 */
public interface InitializationListener {

    /**
     * Called before a dimension resolution pass over every input.
     *
     * @param pass 1-based pass number.
     */
    void onPassStart(int pass);

    /**
     * Called after a resolution pass completed without error.
     *
     * @param pass       1-based pass number.
     * @param unresolved Number of links across the network still lacking
     *                   dimensions.
     */
    void onPassEnd(int pass, int unresolved);

    /**
     * Called once buffers are finalized and every region is initialized.
     *
     * @param passes Number of resolution passes it took to converge.
     */
    void onInitialized(int passes);

    /**
     * Called when initialization fails. The error is rethrown to the caller
     * afterwards.
     */
    void onFailure(int pass, Throwable error);
}
