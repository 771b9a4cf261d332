package com.chanakya.littleyears.store;

/**
 * A record that receives its identifier from the store on insert.
 */
public interface StoredDocument {

    String getId();
}
