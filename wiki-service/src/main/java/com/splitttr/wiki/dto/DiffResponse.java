package com.splitttr.wiki.dto;

import com.splitttr.wiki.service.LineDiff;
import com.splitttr.wiki.service.VersionDiff;

import java.util.List;

// Data model for version comparison response.
public record DiffResponse(
    VersionResponse from,
    VersionResponse to,
    String fromLabel,
    String toLabel,
    long added,
    long removed,
    List<LineDiff.Line> lines,
    String unified
) {
    public static DiffResponse from(VersionDiff diff) {
        return new DiffResponse(
            VersionResponse.from(diff.from()),
            VersionResponse.from(diff.to()),
            diff.from().label(),
            diff.to().label(),
            diff.added(),
            diff.removed(),
            diff.lines(),
            diff.unified(VersionDiff.DEFAULT_CONTEXT));
    }
}
