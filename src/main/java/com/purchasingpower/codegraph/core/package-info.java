/**
 * Core abstractions shared by the search layer and the API.
 *
 * @since 1.0.0
 */
package com.purchasingpower.codegraph.core;
