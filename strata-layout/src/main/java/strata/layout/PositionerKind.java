package strata.layout;

public enum PositionerKind {
  BRANDES_KOPF,
  RANK_PACKER;

  public static PositionerKind fromName(String name) {
    String normalized = name.trim().toLowerCase().replace('_', '-');
    return normalized.equals("rank-packer") || normalized.equals("packer") ? RANK_PACKER : BRANDES_KOPF;
  }
}
