package com.sessionmemory.ai.chat;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import reactor.core.publisher.Flux;

class FakeLanguageModelClient implements LanguageModelClient {

  final List<PromptContext> seen = new ArrayList<>();
  private Function<PromptContext, String> responder = context -> "Echo: " + context.userInput();
  private RuntimeException failure;

  FakeLanguageModelClient answering(Function<PromptContext, String> responder) {
    this.responder = responder;
    return this;
  }

  FakeLanguageModelClient failingWith(RuntimeException failure) {
    this.failure = failure;
    return this;
  }

  @Override
  public String complete(PromptContext context) {
    seen.add(context);
    if (failure != null) {
      throw failure;
    }
    return responder.apply(context);
  }

  @Override
  public Flux<String> stream(PromptContext context) {
    seen.add(context);
    if (failure != null) {
      return Flux.error(failure);
    }
    String answer = responder.apply(context);
    int half = answer.length() / 2;
    return Flux.just(answer.substring(0, half), answer.substring(half));
  }
}
