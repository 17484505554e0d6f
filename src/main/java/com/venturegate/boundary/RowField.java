package com.venturegate.boundary;

/**
 * One entry of a row-to-entity field mapping table: the persistence column name and
 * the normalized property it maps to.
 */
public interface RowField {

    String column();

    String property();
}
