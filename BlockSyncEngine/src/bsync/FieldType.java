package bsync;

/** Editor widget type of a block field. */
public enum FieldType {
  TEXT,
  MULTILINE,
  CHARACTER,
  IMAGE,
  AUDIO,
  LABEL,
  EXPRESSION,
  TRANSITION,
  POSITION,
  SELECT,
  NUMBER,
  BOOLEAN
}
