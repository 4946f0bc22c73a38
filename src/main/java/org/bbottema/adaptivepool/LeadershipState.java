package org.bbottema.adaptivepool;

public enum LeadershipState {
	NOT_LEADER, LEADER
}
