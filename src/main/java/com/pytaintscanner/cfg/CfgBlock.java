package com.pytaintscanner.cfg;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Basic block. Items are IR node ids evaluated in order: simple statements, the header node of a
 * compound statement (its test, iterable or context), or the loop target bound at an iteration step.
 */
public class CfgBlock {
    @Getter
    private final String id;
    @Getter
    private final String irBlockId;
    private final List<String> items = new ArrayList<>();

    public CfgBlock(String id, String irBlockId) {
        this.id = id;
        this.irBlockId = irBlockId;
    }

    void add(String itemId) {
        items.add(itemId);
    }

    public List<String> getItems() {
        return Collections.unmodifiableList(items);
    }

    @Override
    public String toString() {
        return id + items;
    }
}
