package tollgate.adapter.in.dto;

public record ExtendTokenResponse(String tokenId, boolean extended) {}
