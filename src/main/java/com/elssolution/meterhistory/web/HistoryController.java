package com.elssolution.meterhistory.web;

import com.elssolution.meterhistory.domain.DataRangeView;
import com.elssolution.meterhistory.domain.HistoryResponse;
import com.elssolution.meterhistory.service.DataRangeService;
import com.elssolution.meterhistory.service.HistoryQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/device/{deviceId}")
public class HistoryController {

    private final HistoryQueryService history;
    private final DataRangeService dataRange;

    public HistoryController(HistoryQueryService history, DataRangeService dataRange) {
        this.history = history;
        this.dataRange = dataRange;
    }

    @GetMapping("/history")
    public HistoryResponse history(@PathVariable String deviceId,
                                   @RequestParam(name = "start_time", required = false) String startTime,
                                   @RequestParam(name = "end_time", required = false) String endTime,
                                   @RequestParam(name = "time_period", required = false) String timePeriod,
                                   @RequestParam(name = "interval", required = false) String interval) {
        return history.history(deviceId, startTime, endTime, timePeriod, interval);
    }

    @GetMapping("/data-range")
    public DataRangeView dataRange(@PathVariable String deviceId) {
        return dataRange.dataRange(deviceId);
    }
}
