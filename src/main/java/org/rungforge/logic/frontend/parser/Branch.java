package org.rungforge.logic.frontend.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A parallel branch of a rung, or one arm of such a branch.
 * <p>
 * A branch spans the tokens from its '[' to its ']'. Its arms are listed in
 * {@link #getNestedBranches()}: the first arm ({@code <id>:0}) starts at the '[' token, every
 * further arm ({@code <id>:<level>}) starts at the ',' token that introduces it. Positions are only
 * updated by the {@link SequenceBuilder} while the rung is parsed.
 */
public class Branch {

    private final String id;
    private final int startPosition;
    private int endPosition = -1;
    private final String rootBranchId;
    private final boolean arm;
    private final List<Branch> nestedBranches = new ArrayList<>();

    Branch(String id, int startPosition, String rootBranchId, boolean arm) {
        this.id = id;
        this.startPosition = startPosition;
        this.rootBranchId = rootBranchId;
        this.arm = arm;
    }

    public String getId() {
        return id;
    }

    public int getStartPosition() {
        return startPosition;
    }

    public int getEndPosition() {
        return endPosition;
    }

    void setEndPosition(int endPosition) {
        this.endPosition = endPosition;
    }

    /**
     * @return The enclosing branch for a nested branch, the owning branch for an arm, or empty.
     */
    public Optional<String> getRootBranchId() {
        return Optional.ofNullable(rootBranchId);
    }

    /**
     * @return {@code true} if this is an arm of a branch rather than a bracketed branch.
     */
    public boolean isArm() {
        return arm;
    }

    /**
     * @return The arms of this branch, in order. Empty for arms.
     */
    public List<Branch> getNestedBranches() {
        return Collections.unmodifiableList(nestedBranches);
    }

    void addNestedBranch(Branch branch) {
        nestedBranches.add(branch);
    }

    Branch lastNestedBranch() {
        return nestedBranches.get(nestedBranches.size() - 1);
    }

    /**
     * @param position A sequence position.
     * @return {@code true} if the position lies within this branch, bounds included.
     */
    public boolean contains(int position) {
        return position >= startPosition && position <= endPosition;
    }

    @Override
    public String toString() {
        return "Branch{" + id + " [" + startPosition + ".." + endPosition + "], arms=" + nestedBranches.size() + "}";
    }
}
