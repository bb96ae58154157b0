package com.adapterhost.adapters.sql;

/** Result column: label and database type name. */
public record SqlField(String name, String type) {
}
