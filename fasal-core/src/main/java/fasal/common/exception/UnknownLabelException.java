package fasal.common.exception;

/**
 * Classifier output that has no counterpart in the label table or the knowledge base.
 */
public class UnknownLabelException extends RRException {
    private static final long serialVersionUID = 1L;

    public UnknownLabelException(String msg) {
        super(500, msg);
    }
}
