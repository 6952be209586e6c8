package com.pagewatch.service.command;

public record CommandReply(boolean ok, String text) {
    public static CommandReply ok(String text) {
        return new CommandReply(true, text);
    }

    public static CommandReply failed(String text) {
        return new CommandReply(false, text);
    }
}
