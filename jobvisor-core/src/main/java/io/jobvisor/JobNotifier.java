package io.jobvisor;

/**
 * Operator-facing sink for supervision events. Delivery (mail, chat) is up to the implementation.
 */
public interface JobNotifier {

    /**
     * A program died or failed its probe and is being restarted.
     */
    void notifyDown(String name, String detail);

    /**
     * A program that had been failing passed a liveness check again.
     */
    void notifyUp(String name, String detail);

    /**
     * A job reached a terminal failure and needs a human.
     */
    void notifyFailure(String name, int failures, String detail);
}
