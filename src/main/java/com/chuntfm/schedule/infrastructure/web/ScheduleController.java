package com.chuntfm.schedule.infrastructure.web;

import com.chuntfm.schedule.application.FindSchedule;
import com.chuntfm.schedule.domain.model.ScheduleEntry;
import com.chuntfm.schedule.infrastructure.web.dto.ScheduleEntryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/schedule")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final FindSchedule findSchedule;

    public ScheduleController(FindSchedule findSchedule) {
        this.findSchedule = findSchedule;
    }

    @GetMapping("/previous")
    public ResponseEntity<List<Map<String, Object>>> previous() {
        return respond("previous", findSchedule.previous());
    }

    @GetMapping("/upnext")
    public ResponseEntity<List<Map<String, Object>>> upNext() {
        return respond("upnext", findSchedule.upNext());
    }

    @GetMapping("/now")
    public ResponseEntity<List<Map<String, Object>>> now() {
        return respond("now", findSchedule.now());
    }

    @GetMapping("/when")
    public ResponseEntity<List<Map<String, Object>>> when(
            @RequestParam(value = "title", required = false) String title,
            @RequestParam(value = "description", required = false) String description
    ) {
        logger.info("Searching schedule for title '{}' and description '{}'", title, description);
        return respond("when", findSchedule.when(title, description));
    }

    @GetMapping("/what")
    public ResponseEntity<List<Map<String, Object>>> what(@RequestParam("time") String time) {
        logger.info("Finding schedule at {}", time);
        return respond("what", findSchedule.what(time));
    }

    private ResponseEntity<List<Map<String, Object>>> respond(String query, List<ScheduleEntry> entries) {
        logger.debug("Schedule query '{}' returned {} entries", query, entries.size());
        return ResponseEntity.ok(ScheduleEntryResponse.fromEntries(entries));
    }
}
