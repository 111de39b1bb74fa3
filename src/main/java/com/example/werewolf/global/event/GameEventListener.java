package com.example.werewolf.global.event;

@FunctionalInterface
public interface GameEventListener {

    void onEvent(GameEvent event);
}
