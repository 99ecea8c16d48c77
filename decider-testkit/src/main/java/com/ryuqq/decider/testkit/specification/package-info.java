/**
 * Given/when/then specifications for deciders and views, built on AssertJ.
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.testkit.specification;
