package com.clawcron.cron;

import com.clawcron.cron.CronTypes.CronJobCreate;
import com.clawcron.cron.CronTypes.Every;
import com.clawcron.cron.CronTypes.SystemEvent;

import java.nio.file.Path;

/**
 * Creates jobs against a store from a separate JVM, for the cross-process
 * writer tests. Arguments: store path, name prefix, job count. Prints
 * {@code CREATED <n>} when done.
 */
public final class ExternalCronWriter {

    private ExternalCronWriter() {
    }

    public static void main(String[] args) {
        Path storePath = Path.of(args[0]);
        String prefix = args[1];
        int count = Integer.parseInt(args[2]);

        CronService service = new CronService(new CronStore(storePath, new CronStoreOptions(30_000, 5)));
        int created = 0;
        for (int i = 0; i < count; i++) {
            CronJobCreate input = CronJobCreate.builder()
                    .name(prefix + i)
                    .schedule(new Every(60_000, 0L))
                    .payload(new SystemEvent("tick"))
                    .build();
            if (service.create(input, i).ok())
                created++;
        }
        System.out.println("CREATED " + created);
    }
}
