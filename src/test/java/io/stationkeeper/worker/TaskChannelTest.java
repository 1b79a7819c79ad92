package io.stationkeeper.worker;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class TaskChannelTest {

    @Test
    void deliversHeartbeatsThenOneTerminalMessage() {
        TaskChannel<String> channel = new TaskChannel<>();
        channel.heartbeat();
        channel.complete("done");

        Assertions.assertTrue(channel.isFinished());
        Assertions.assertTrue(channel.lastHeartbeat().isPresent());
        Assertions.assertTrue(channel.poll().orElseThrow() instanceof TaskChannel.TaskMessage.Heartbeat);
        TaskChannel.TaskMessage<String> terminal = channel.poll().orElseThrow();
        Assertions.assertEquals(new TaskChannel.TaskMessage.Result<>("done"), terminal);
        Assertions.assertTrue(channel.poll().isEmpty());
        Assertions.assertThrows(IllegalStateException.class, () -> channel.fail("late"));
        Assertions.assertEquals(terminal, channel.terminal().orElseThrow());
    }

    @Test
    void failureIsTerminal() {
        TaskChannel<Integer> channel = new TaskChannel<>();
        Assertions.assertFalse(channel.isFinished());

        channel.fail("child process died");

        Assertions.assertEquals(new TaskChannel.TaskMessage.Failure<Integer>("child process died"), channel.terminal().orElseThrow());
        Assertions.assertThrows(IllegalStateException.class, () -> channel.complete(1));
    }
}
