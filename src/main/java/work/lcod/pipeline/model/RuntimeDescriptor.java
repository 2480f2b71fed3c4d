package work.lcod.pipeline.model;

/**
 * Describes how a function program is executed.
 */
public interface RuntimeDescriptor {
    RuntimeKind kind();

    /**
     * Human readable reference (image or executable path) used to name result sets.
     */
    String reference();
}
