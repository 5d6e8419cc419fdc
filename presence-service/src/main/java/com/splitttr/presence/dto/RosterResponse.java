package com.splitttr.presence.dto;

import com.splitttr.presence.message.ServerMessage.Editor;

import java.util.List;

public record RosterResponse(List<Editor> editors) {}
