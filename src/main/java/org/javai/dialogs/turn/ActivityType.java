package org.javai.dialogs.turn;

public enum ActivityType {
	MESSAGE,
	CONVERSATION_UPDATE
}
