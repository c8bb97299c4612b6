package com.danieljhkim.tabletmgr.tmagent.agent;

/**
 * Lifecycle of an {@link ActionAgent}. Transitions only move forward; a stopped agent is replaced, not restarted.
 */
public enum AgentState {
	UNINITIALIZED,
	STARTING,
	RUNNING,
	STOPPED
}
