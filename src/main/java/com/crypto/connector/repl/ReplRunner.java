package com.crypto.connector.repl;

import com.crypto.connector.common.command.Command;
import com.crypto.connector.common.command.CommandType;
import com.crypto.connector.common.command.impl.CommandParser;
import com.crypto.connector.common.model.CommandResult;
import com.crypto.connector.common.service.CommandExecutor;
import com.crypto.connector.common.service.ConsolePrompt;
import com.crypto.connector.common.util.ConsoleOutput;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ReplRunner {

    private final CommandParser parser;
    private final CommandExecutor executor;
    private final ConsolePrompt prompt;

    public ReplRunner(CommandParser parser, CommandExecutor executor, ConsolePrompt prompt) {
        this.parser = parser;
        this.executor = executor;
        this.prompt = prompt;
    }

    public void run() {
        ConsoleOutput.printlnGreen("Exchange Connector REPL. Type 'help' for commands, 'exit' to quit.");
        try {
            while (true) {
                String line = prompt.readLine("> ");
                if (line == null) {
                    break;
                }
                if (line.isBlank()) {
                    continue;
                }
                Command command = parser.parse(line);
                if (command.type() == CommandType.EXIT) {
                    ConsoleOutput.printlnGreen("Bye.");
                    break;
                }
                CommandResult result = executor.execute(command);
                print(result);
            }
        } catch (Exception e) {
            LOG.error("REPL failed: {}", e.getMessage());
            System.err.println("REPL failed: " + e.getMessage());
        }
    }

    private static void print(CommandResult result) {
        if (result == null || result.message == null || result.message.isEmpty()) {
            return;
        }
        if (result.success) {
            ConsoleOutput.printlnGreen(result.message);
        } else {
            ConsoleOutput.printlnRed(result.message);
        }
    }
}
