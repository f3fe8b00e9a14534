/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.app;

import java.util.List;
import java.util.Locale;

import io.ferryman.engine.CommandDispatcher;
import io.ferryman.engine.EngineLifecycleHooks;
import io.ferryman.engine.EngineSession;
import io.ferryman.engine.SessionListener;
import io.ferryman.protocol.RestartMode;

/**
 * Stand-in game logic so an engine can run without one. Understands a handful of commands
 * and echoes everything else.
 *
 * <pre>
 *   login &lt;account&gt;    authenticate the session, creating a puppet named after the
 *                       account when the policy asks for it
 *   puppet &lt;name&gt;      bind a puppet
 *   who                 show this session's account and puppet
 *   quit                disconnect
 * </pre>
 */
class LineEchoDispatcher implements CommandDispatcher, SessionListener, EngineLifecycleHooks {

    private volatile RestartMode startMode = RestartMode.COLD;

    @Override
    public void engineStarting(RestartMode mode) {
        this.startMode = mode;
    }

    @Override
    public List<byte[]> dispatch(EngineSession session, byte[] input) {
        String line = new String(input, session.encoding()).strip();
        if (line.isEmpty()) {
            return List.of();
        }
        String[] words = line.split("\\s+", 2);
        String verb = words[0].toLowerCase(Locale.ROOT);
        String argument = words.length > 1 ? words[1] : "";
        switch (verb) {
            case "login":
                if (argument.isEmpty()) {
                    return lines(session, "Usage: login <account>");
                }
                session.authenticate(argument);
                if (session.puppetRef() == null && session.policy().autoCreatePuppet()) {
                    session.bindPuppet(argument);
                }
                return lines(session, "Logged in as " + argument + describePuppet(session));
            case "puppet":
                if (!session.isAuthenticated()) {
                    return lines(session, "You must log in first.");
                }
                if (argument.isEmpty()) {
                    return lines(session, "Usage: puppet <name>");
                }
                session.bindPuppet(argument);
                return lines(session, "You are now " + argument + ".");
            case "who":
                return lines(session, "Session " + session.id() + ": account=" + session.accountId() + ", puppet=" + session.puppetRef());
            case "quit":
                session.disconnect("quit");
                return List.of();
            default:
                return lines(session, "You said: " + line);
        }
    }

    @Override
    public void sessionOpened(EngineSession session) {
        session.sendLine("Welcome. Type 'login <account>' to begin.");
    }

    @Override
    public void sessionResumed(EngineSession session) {
        session.sendLine(startMode == RestartMode.RELOAD ? "The server has reloaded." : "The server has restarted.");
    }

    private static String describePuppet(EngineSession session) {
        return session.puppetRef() != null ? ", puppeting " + session.puppetRef() + "." : ".";
    }

    private static List<byte[]> lines(EngineSession session, String text) {
        byte[] bytes = (text + "\r\n").getBytes(session.encoding());
        return List.of(bytes);
    }
}
