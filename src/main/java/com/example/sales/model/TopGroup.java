package com.example.sales.model;

/**
 * The group with the largest total amount, together with its statistics.
 */
public record TopGroup(GroupKey key, GroupStats stats) {
}
