package me.golemcore.relay.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.relay.domain.model.CronPayload;
import me.golemcore.relay.domain.model.CronSchedule;

/**
 * Create or patch body for a cron job.
 *
 * <p>
 * The schedule is given either structured ({@code schedule} with a
 * {@code kind}) or with the shorthand fields {@code at}, {@code every} (plus
 * {@code anchor}) or {@code cron} (plus {@code tz}). Likewise the payload is
 * either structured or given as {@code systemEvent} text for main jobs, or
 * {@code message} with the agent-turn options for isolated jobs. On patch,
 * absent fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronJobRequest {

    private String name;
    private Boolean enabled;
    private String sessionTarget;
    private String wakeMode;

    private CronSchedule schedule;
    private String at;
    private String every;
    private String anchor;
    private String cron;
    private String tz;

    private CronPayload payload;
    private String systemEvent;
    private String message;
    private String thinking;
    private Integer timeoutSeconds;
    private Boolean deliver;
    private String channel;
    private String to;
    private Boolean bestEffortDeliver;

    private String postToMainPrefix;

    public boolean hasScheduleShorthand() {
        return at != null || every != null || cron != null;
    }

    public boolean hasAgentTurnFields() {
        return message != null || thinking != null || timeoutSeconds != null || deliver != null
                || channel != null || to != null || bestEffortDeliver != null;
    }
}
