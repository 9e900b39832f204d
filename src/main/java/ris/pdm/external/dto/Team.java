package ris.pdm.external.dto;

public record Team(String id, String name) {}
