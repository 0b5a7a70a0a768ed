package com.gentoro.deepresearch.task;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ProgressStreamTest {

  private final TaskManager tasks = new TaskManager();
  private final BlockingQueue<ProgressEvent> events = new LinkedBlockingQueue<>();
  private final ExecutorService pool = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  private ProgressEvent next() throws InterruptedException {
    ProgressEvent event = events.poll(5, TimeUnit.SECONDS);
    assertNotNull(event, "no event received");
    return event;
  }

  @Test
  void unknownTaskIsReportedAndNothingIsSent() throws Exception {
    ProgressStream stream = new ProgressStream(tasks);
    assertFalse(stream.stream("missing", events::add));
    assertTrue(events.isEmpty());
  }

  @Test
  void currentSnapshotIsSentFirstAsSnakeCaseJson() throws Exception {
    tasks.createTask("t1");
    tasks.updateTask("t1", TaskUpdate.completed("# Report"));

    assertTrue(new ProgressStream(tasks).stream("t1", events::add));

    assertEquals(1, events.size());
    ProgressEvent event = events.poll();
    assertEquals(ProgressEvent.PROGRESS, event.name());
    assertFalse(event.isKeepalive());
    assertTrue(event.data().contains("\"task_id\":\"t1\""));
    assertTrue(event.data().contains("\"status\":\"completed\""));
    assertTrue(event.data().contains("\"current_step\":\"Completed\""));
    assertTrue(event.data().contains("\"percent\":100"));
    assertTrue(event.data().contains("\"created_at\":\""));
  }

  @Test
  void updatesAreForwardedBeforeTheKeepaliveFires() throws Exception {
    tasks.createTask("t1");
    ProgressStream stream = new ProgressStream(tasks, Duration.ofSeconds(30));
    Future<Boolean> running = pool.submit(() -> stream.stream("t1", events::add));

    ProgressEvent initial = next();
    assertTrue(initial.data().contains("\"percent\":0"));

    tasks.updateTask("t1", TaskUpdate.stage(TaskStatus.SEARCHING, "Running 2 searches...", 30));
    ProgressEvent update = events.poll(2, TimeUnit.SECONDS);
    assertNotNull(update);
    assertEquals(ProgressEvent.PROGRESS, update.name());
    assertTrue(update.data().contains("\"percent\":30"));
    assertTrue(update.data().contains("\"status\":\"searching\""));

    tasks.updateTask("t1", TaskUpdate.completed("done"));
    assertTrue(next().data().contains("\"status\":\"completed\""));
    assertTrue(running.get(5, TimeUnit.SECONDS));
    assertEquals(0, tasks.subscriberCount("t1"));
  }

  @Test
  void pingIsSentWhenNothingHappens() throws Exception {
    tasks.createTask("t1");
    ProgressStream stream = new ProgressStream(tasks, Duration.ofMillis(50));
    Future<Boolean> running = pool.submit(() -> stream.stream("t1", events::add));

    assertEquals(ProgressEvent.PROGRESS, next().name());
    ProgressEvent ping = next();
    assertTrue(ping.isKeepalive());
    assertEquals("", ping.data());

    tasks.updateTask("t1", TaskUpdate.failed("boom"));
    assertTrue(running.get(5, TimeUnit.SECONDS));

    List<ProgressEvent> rest = new ArrayList<>();
    events.drainTo(rest);
    ProgressEvent last = rest.get(rest.size() - 1);
    assertEquals(ProgressEvent.PROGRESS, last.name());
    assertTrue(last.data().contains("\"error\":\"boom\""));
  }

  @Test
  void updatesDuringFirstSendAreEachSentOnce() throws Exception {
    tasks.createTask("t1");
    List<ProgressEvent> sent = new ArrayList<>();
    ProgressSink sink =
        event -> {
          sent.add(event);
          if (sent.size() == 1) {
            // lands after registration, before the stream starts polling
            tasks.updateTask("t1", TaskUpdate.stage(TaskStatus.SEARCHING, "Searching", 30));
            tasks.updateTask("t1", TaskUpdate.completed("done"));
          }
        };

    assertTrue(new ProgressStream(tasks, Duration.ofSeconds(5)).stream("t1", sink));

    assertEquals(3, sent.size());
    assertTrue(sent.get(0).data().contains("\"percent\":0"));
    assertTrue(sent.get(1).data().contains("\"percent\":30"));
    assertTrue(sent.get(2).data().contains("\"status\":\"completed\""));
  }

  @Test
  void closedSinkEndsTheStream() throws Exception {
    tasks.createTask("t1");
    List<ProgressEvent> sent = new ArrayList<>();
    ProgressSink oneShot =
        new ProgressSink() {
          @Override
          public void send(ProgressEvent event) {
            sent.add(event);
          }

          @Override
          public boolean isOpen() {
            return sent.isEmpty();
          }
        };

    assertTrue(new ProgressStream(tasks, Duration.ofMillis(50)).stream("t1", oneShot));
    assertEquals(1, sent.size());
    assertEquals(0, tasks.subscriberCount("t1"));
  }

  @Test
  void keepaliveMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new ProgressStream(tasks, Duration.ZERO));
  }
}
