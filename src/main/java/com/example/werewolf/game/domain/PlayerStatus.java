package com.example.werewolf.game.domain;

public enum PlayerStatus {
    ALIVE,
    DEAD
}
