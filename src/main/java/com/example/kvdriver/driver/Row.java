package com.example.kvdriver.driver;

import lombok.Value;

/** One (key, value) pair of a table. */
@Value
public class Row {
    String id;
    Object value;
}
