package org.modulematch.session;

/**
 * Answer to "is this phenotype present?".
 */
public enum Answer {
    YES,
    NO,
    UNKNOWN
}
