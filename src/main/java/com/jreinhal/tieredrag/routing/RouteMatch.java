package com.jreinhal.tieredrag.routing;

public record RouteMatch(String knowledgeBase, double similarity) {
}
