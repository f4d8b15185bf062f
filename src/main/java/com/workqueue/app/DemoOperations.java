package com.workqueue.app;

import com.google.gson.Gson;
import com.workqueue.core.JobContext;
import com.workqueue.registry.OperationRegistry;
import com.workqueue.registry.ParamKind;
import com.workqueue.registry.SubjectSet;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Sample operations registered by {@link Main} so the host has something to run:
 * {@code Mail.Send}, {@code Maintenance.Cleanup}, {@code Maintenance.Fail} and
 * {@code Report.Generate}. They simulate work with short sleeps.
 */
public final class DemoOperations {
    private static final Logger logger = Logger.getLogger(DemoOperations.class.getName());
    private static final Gson gson = new Gson();

    /** Structured argument of {@code Maintenance.Cleanup}. */
    static class CleanupData {
        String directory;
        int daysOld;
        String filePattern;
    }

    private DemoOperations() {
    }

    public static void register(OperationRegistry registry) {
        registry.domain("Mail")
                .operation("Send", DemoOperations::sendMail, ParamKind.SCALAR, ParamKind.SCALAR);
        registry.domain("Maintenance")
                .operation("Cleanup", DemoOperations::cleanup, ParamKind.STRUCTURED)
                .operation("Fail", DemoOperations::fail, ParamKind.SCALAR);
        registry.domain("Report")
                .operation("Generate", DemoOperations::generateReport, ParamKind.SCALAR, ParamKind.SCALAR);
        logger.info("Registered demo operations in domains " + registry.domainNames());
    }

    // Mail.Send(subject, body) to every subject id
    static Object sendMail(JobContext context, SubjectSet recipients, List<Object> args) throws Exception {
        String subject = (String) args.get(0);
        if (recipients.isEmpty()) {
            throw new IllegalArgumentException("No recipient given for '" + subject + "'");
        }
        context.log("INFO", "Connecting to email server");
        Thread.sleep(200);
        for (Long recipient : recipients.getIds()) {
            context.log("INFO", "Sending '" + subject + "' to recipient " + recipient);
            Thread.sleep(50);
        }
        return "Sent '" + subject + "' to " + recipients.size() + " recipient(s)";
    }

    // Maintenance.Cleanup({directory, daysOld, filePattern})
    static Object cleanup(JobContext context, SubjectSet subjects, List<Object> args) throws Exception {
        @SuppressWarnings("unchecked")
        Map<String, Object> raw = (Map<String, Object>) args.get(0);
        CleanupData data = gson.fromJson(gson.toJsonTree(raw), CleanupData.class);
        if (data == null || data.directory == null) {
            throw new IllegalArgumentException("Invalid cleanup data");
        }

        context.log("INFO", "Starting file cleanup in " + data.directory);
        Thread.sleep(300);
        int filesFound = 20 + new Random().nextInt(81);
        context.log("INFO", "Found " + filesFound + " files matching " + data.filePattern
                + " older than " + data.daysOld + " days");
        Thread.sleep(filesFound * 5L);
        return "Cleanup completed: " + filesFound + " files removed";
    }

    // Maintenance.Fail(reason): always raises
    static Object fail(JobContext context, SubjectSet subjects, List<Object> args) {
        String reason = String.valueOf(args.get(0));
        context.log("ERROR", "Failing on purpose: " + reason);
        throw new IllegalStateException(reason);
    }

    // Report.Generate(type, month); returns nothing so the default result is stored
    static Object generateReport(JobContext context, SubjectSet subjects, List<Object> args) throws Exception {
        String type = (String) args.get(0);
        String month = (String) args.get(1);
        context.log("INFO", "Generating " + type + " report for " + month + " as " + context.getOwner());
        Thread.sleep(500);
        context.log("INFO", "Report " + type + "/" + month + " ready");
        return null;
    }
}
