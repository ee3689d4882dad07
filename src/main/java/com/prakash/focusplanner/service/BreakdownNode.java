package com.prakash.focusplanner.service;

import com.prakash.focusplanner.model.Commitment;

import java.util.ArrayList;
import java.util.List;

/**
 * A commitment with its breakdown subtree.
 */
public record BreakdownNode(Commitment commitment, List<BreakdownNode> children) {

    public int descendantCount() {
        int count = children.size();
        for (BreakdownNode child : children) {
            count += child.descendantCount();
        }
        return count;
    }

    /**
     * Every commitment in the subtree below this node, parents before their children.
     */
    public List<Commitment> descendants() {
        List<Commitment> result = new ArrayList<>();
        for (BreakdownNode child : children) {
            result.add(child.commitment());
            result.addAll(child.descendants());
        }
        return result;
    }
}
