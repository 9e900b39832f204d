package ris.pdm.external.dto;

public record TeamMember(String id, String displayName, String uniqueName, String imageUrl) {}
