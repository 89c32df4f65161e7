package com.flagship.iam_service.domain.iam;

/**
 * A single bit (or the zero default) of a permission bitmask.
 */
public interface Permission {

    int getValue();
}
