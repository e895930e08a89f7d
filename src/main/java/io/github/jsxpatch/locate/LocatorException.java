package io.github.jsxpatch.locate;

import io.github.jsxpatch.VisualEditException;

/**
 * No element could be resolved from an identifying payload.
 */
public class LocatorException extends VisualEditException {
    public enum Reason {
        /** Neither a position token nor any class tokens were supplied. */
        NO_IDENTIFYING_INFORMATION,
        /** Identifying information was supplied but nothing in the current source matched it well enough. */
        STRUCTURE_CHANGED
    }

    private final Reason reason;

    public LocatorException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    static LocatorException noIdentifyingInformation() {
        return new LocatorException(Reason.NO_IDENTIFYING_INFORMATION,
                                    "Cannot find element: no shipper ID or className provided for matching.");
    }

    static LocatorException structureChanged() {
        return new LocatorException(Reason.STRUCTURE_CHANGED,
                                    "Cannot find element. The element may have been modified or the file structure may have changed.");
    }
}
