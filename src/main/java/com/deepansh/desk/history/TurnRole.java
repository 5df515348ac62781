package com.deepansh.desk.history;

public enum TurnRole {
    USER, AGENT, TOOL
}
