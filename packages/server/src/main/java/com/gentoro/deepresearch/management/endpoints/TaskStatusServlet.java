package com.gentoro.deepresearch.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.deepresearch.task.TaskManager;
import com.gentoro.deepresearch.task.TaskProgress;
import com.gentoro.deepresearch.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;

/** GET /mng/tasks/{id} returns the latest snapshot of a task. */
public final class TaskStatusServlet extends HttpServlet {
  private final TaskManager tasks;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public TaskStatusServlet(TaskManager tasks) {
    this.tasks = tasks;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String taskId = req.getPathInfo();
    if (taskId == null || taskId.length() <= 1) {
      resp.sendError(400, "Missing taskId");
      return;
    }
    taskId = taskId.substring(1);

    Optional<TaskProgress> task = tasks.getTask(taskId);
    if (task.isEmpty()) {
      resp.sendError(404, "Unknown taskId");
      return;
    }

    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(task.get()));
  }
}
