package com.sommerph.certdir.model;

/**
 * A secondary identifier that can be resolved through one of the index families.
 */
public interface Identifier {

    IndexKind getIndexKind();

    /**
     * The canonical string form, used verbatim (or encoded, for emails) as the index entry name.
     */
    String toString();

}
