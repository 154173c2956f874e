package io.surfworks.spectrastack.core.view;

/**
 * Lifecycle of a {@link StackView}. A view is traversed at most once.
 */
public enum ViewState {
    CONSTRUCTED,
    ITERATING,
    EXHAUSTED
}
