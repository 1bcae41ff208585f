package io.pipetrak.progress.template;

/** Whether a resolved schedule is the type default or carries project overrides. */
public enum TemplateScope {
  DEFAULT,
  PROJECT_OVERRIDE
}
