package bsync;

import java.util.Optional;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Mirrors a single block field edit onto the paired AST entity. Field names a kind does not map
 * are ignored. Every mutation goes through the {@link EditLog} so a failed update can be undone.
 */
final class PropertySync {
  private static final Splitter WORDS = Splitter.on(' ').trimResults().omitEmptyStrings();
  private static final Splitter LIST = Splitter.on(',').trimResults().omitEmptyStrings();

  static ImmutableList<String> words(String text) {
    return ImmutableList.copyOf(WORDS.split(text));
  }

  static ImmutableList<String> list(String text) {
    return ImmutableList.copyOf(LIST.split(text));
  }

  /** The field's text, or empty if it is unset or blank. */
  static Optional<String> optional(Block block, String fieldName) {
    String text = block.text(fieldName);
    return text.trim().isEmpty() ? Optional.empty() : Optional.of(text);
  }

  /** Applies the current value of {@code block.fieldName} to the AST of {@code label}. */
  void sync(Block block, String fieldName, AST ast, AST.Label label, EditLog log)
      throws SyncException {
    switch (block.kind()) {
      case COMMENT:
        return;
      case LABEL:
        syncLabel(block, fieldName, ast, label, log);
        return;
      case CHOICE:
        syncChoice(block, fieldName, label, log);
        return;
      case ELIF:
        if (fieldName.equals("condition")) {
          Statement.If.Branch branch = resolve(block, label).branch();
          log.set(branch::condition, branch::setCondition, condition(block));
        }
        return;
      case ELSE:
        return;
      default:
        syncStatement(block, fieldName, statement(block, label), log);
    }
  }

  private static void syncLabel(
      Block block, String fieldName, AST ast, AST.Label label, EditLog log) throws SyncException {
    switch (fieldName) {
      case "name":
        String name = block.text("name").trim();
        if (name.isEmpty()) {
          throw new SyncException(Failure.invalidValue("label name cannot be empty"));
        }
        Optional<AST.Label> existing = ast.label(name);
        if (existing.isPresent() && existing.get() != label) {
          throw new SyncException(Failure.invalidValue("label %s already exists", name));
        }
        log.set(label::name, label::setName, name);
        break;
      case "parameters":
        log.set(label::parameters, label::setParameters, list(block.text("parameters")));
        break;
      default:
        break;
    }
  }

  private static void syncChoice(Block block, String fieldName, AST.Label label, EditLog log)
      throws SyncException {
    Statement.Menu.Choice choice = resolve(block, label).choice();
    switch (fieldName) {
      case "text":
        log.set(choice::text, choice::setText, block.text("text"));
        break;
      case "condition":
        log.set(choice::condition, choice::setCondition, optional(block, "condition"));
        break;
      default:
        break;
    }
  }

  private static void syncStatement(Block block, String fieldName, Statement node, EditLog log)
      throws SyncException {
    String text = block.text(fieldName);
    switch (block.kind()) {
      case DIALOGUE:
        Statement.Dialogue dialogue = node.cast();
        if (fieldName.equals("speaker")) {
          log.set(dialogue::speaker, dialogue::setSpeaker, optional(block, fieldName));
        } else if (fieldName.equals("text")) {
          log.set(dialogue::text, dialogue::setText, text);
        } else if (fieldName.equals("attributes")) {
          log.set(dialogue::attributes, dialogue::setAttributes, words(text));
        }
        break;
      case SCENE:
        Statement.Scene scene = node.cast();
        if (fieldName.equals("image")) {
          log.set(scene::image, scene::setImage, text);
        } else if (fieldName.equals("onLayer")) {
          log.set(scene::layer, scene::setLayer, optional(block, fieldName));
        }
        break;
      case SHOW:
        Statement.Show show = node.cast();
        if (fieldName.equals("character")) {
          log.set(show::image, show::setImage, text);
        } else if (fieldName.equals("position")) {
          log.set(show::atPosition, show::setAtPosition, optional(block, fieldName));
        } else if (fieldName.equals("expression")) {
          log.set(show::attributes, show::setAttributes, words(text));
        }
        break;
      case HIDE:
        Statement.Hide hide = node.cast();
        if (fieldName.equals("character")) log.set(hide::image, hide::setImage, text);
        break;
      case WITH:
        Statement.With with = node.cast();
        if (fieldName.equals("transition")) {
          log.set(
              with::transition,
              with::setTransition,
              optional(block, fieldName).orElse(Statement.With.DEFAULT_TRANSITION));
        }
        break;
      case MENU:
        Statement.Menu menu = node.cast();
        if (fieldName.equals("prompt")) {
          log.set(menu::prompt, menu::setPrompt, optional(block, fieldName));
        }
        break;
      case JUMP:
        Statement.Jump jump = node.cast();
        if (fieldName.equals("target")) {
          log.set(jump::target, jump::setTarget, text);
        } else if (fieldName.equals("expression")) {
          log.set(jump::expression, jump::setExpression, flag(block, fieldName).orElse(false));
        }
        break;
      case CALL:
        Statement.Call call = node.cast();
        if (fieldName.equals("target")) {
          log.set(call::target, call::setTarget, text);
        } else if (fieldName.equals("arguments")) {
          log.set(call::arguments, call::setArguments, list(text));
        } else if (fieldName.equals("expression")) {
          log.set(call::expression, call::setExpression, flag(block, fieldName).orElse(false));
        }
        break;
      case RETURN:
        Statement.Return ret = node.cast();
        if (fieldName.equals("value")) {
          log.set(ret::value, ret::setValue, optional(block, fieldName));
        }
        break;
      case IF:
        Statement.If ifStatement = node.cast();
        if (fieldName.equals("condition")) {
          if (ifStatement.branches().isEmpty()) {
            throw new SyncException(Failure.notFound("if %s has no branches", ifStatement.id()));
          }
          Statement.If.Branch first = ifStatement.branches().get(0);
          log.set(first::condition, first::setCondition, condition(block));
        }
        break;
      case PYTHON:
        Statement.Python python = node.cast();
        if (fieldName.equals("code")) log.set(python::code, python::setCode, text);
        break;
      case SET:
        Statement.Set set = node.cast();
        if (fieldName.equals("variable")) {
          log.set(set::variable, set::setVariable, text);
        } else if (fieldName.equals("operator")) {
          Optional<Statement.Set.Operator> operator = Statement.Set.Operator.forSymbol(text);
          if (!operator.isPresent()) {
            throw new SyncException(Failure.invalidValue("unknown set operator: %s", text));
          }
          log.set(set::operator, set::setOperator, operator.get());
        } else if (fieldName.equals("value")) {
          log.set(set::value, set::setValue, text);
        }
        break;
      case PLAY_MUSIC:
      case PLAY_SOUND:
        Statement.Play play = node.cast();
        if (fieldName.equals("file")) {
          log.set(play::file, play::setFile, text);
        } else if (fieldName.equals("fadein")) {
          log.set(play::fadeIn, play::setFadeIn, number(block, fieldName));
        } else if (fieldName.equals("volume")) {
          log.set(play::volume, play::setVolume, number(block, fieldName));
        } else if (fieldName.equals("loop")) {
          log.set(play::loop, play::setLoop, flag(block, fieldName));
        }
        break;
      case STOP_MUSIC:
        Statement.Stop stop = node.cast();
        if (fieldName.equals("fadeout")) {
          log.set(stop::fadeOut, stop::setFadeOut, number(block, fieldName));
        }
        break;
      default:
        throw new AssertionError(block.kind());
    }
  }

  private static Statement statement(Block block, AST.Label label) throws SyncException {
    Address link = link(block);
    Optional<Statement> node = AddressResolver.findAstNode(label, link.node());
    if (!node.isPresent()) {
      throw new SyncException(Failure.notFound("no statement %s for %s", link, block));
    }
    return node.get();
  }

  private static AstTarget resolve(Block block, AST.Label label) throws SyncException {
    Address link = link(block);
    Optional<AstTarget> target = AddressResolver.resolve(link, label);
    if (!target.isPresent()) {
      throw new SyncException(Failure.notFound("no AST entity %s for %s", link, block));
    }
    return target.get();
  }

  private static Address link(Block block) throws SyncException {
    if (!block.link().isPresent()) {
      throw new SyncException(Failure.notFound("%s is not linked to the AST", block));
    }
    return block.link().get();
  }

  private static Optional<String> condition(Block block) {
    return Optional.of(optional(block, "condition").orElse(Statement.If.DEFAULT_CONDITION));
  }

  private static Optional<Double> number(Block block, String fieldName) throws SyncException {
    Optional<FieldValue> value = block.value(fieldName);
    if (!value.isPresent() || value.get().asText().trim().isEmpty()) return Optional.empty();

    Optional<Double> number = value.get().asNumber();
    if (!number.isPresent()) {
      throw new SyncException(
          Failure.invalidValue("%s of %s is not a number: %s", fieldName, block, value.get()));
    }
    return number;
  }

  private static Optional<Boolean> flag(Block block, String fieldName) throws SyncException {
    Optional<FieldValue> value = block.value(fieldName);
    if (!value.isPresent()) return Optional.empty();

    Optional<Boolean> flag = value.get().asFlag();
    if (!flag.isPresent()) {
      throw new SyncException(
          Failure.invalidValue("%s of %s is not true or false: %s", fieldName, block, value.get()));
    }
    return flag;
  }
}
