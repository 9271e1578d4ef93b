package com.elssolution.meterhistory.integration.influx;

import com.elssolution.meterhistory.integration.BackendUnavailableException;
import com.influxdb.client.QueryApi;
import com.influxdb.exceptions.InfluxException;
import com.influxdb.query.FluxRecord;
import com.influxdb.query.FluxTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class InfluxColumnarReadClient implements ColumnarReadClient {

    private final QueryApi queryApi;
    private final String orgName;

    public InfluxColumnarReadClient(QueryApi queryApi, String orgName) {
        this.queryApi = queryApi;
        this.orgName = orgName;
    }

    @Override
    public List<FluxRecord> query(String flux) {
        if (log.isTraceEnabled()) log.trace("flux_query org={}\n{}", orgName, flux);
        List<FluxTable> tables;
        try {
            tables = queryApi.query(flux, orgName);
        } catch (InfluxException e) {
            throw new BackendUnavailableException("influx query failed: " + e.getMessage(), e);
        }
        List<FluxRecord> out = new ArrayList<>();
        for (FluxTable t : tables) {
            out.addAll(t.getRecords());
        }
        return out;
    }
}
