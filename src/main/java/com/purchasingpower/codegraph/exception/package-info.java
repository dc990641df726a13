/**
 * Unchecked exception hierarchy rooted at
 * {@link com.purchasingpower.codegraph.exception.CodeGraphException}.
 */
package com.purchasingpower.codegraph.exception;
