package org.crashgame.model.crash;

public enum GamePhase { WAITING, RUNNING, CRASHED }
