package io.sigmatics.core.compiler;

/**
 * Facts gathered in one walk over a tree.
 *
 * @param seqDepth maximum nesting of {@code seq} nodes on any root-to-leaf path
 * @param classPure {@code true} when no grade projection is reachable
 * @param runtimeInputs {@code true} when some atom reads a runtime parameter (param, ring ops, class
 *     projection)
 * @param singleAtom {@code true} when the tree is one atom with no transforms or composition
 */
public record ComplexitySignals(int seqDepth, boolean classPure, boolean runtimeInputs, boolean singleAtom) {}
