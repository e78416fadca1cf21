/**
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.beatstore.scheduler.config;

import org.beatstore.scheduler.app.SchedulerMain;
import org.beatstore.scheduler.beat.BeatModule;
import org.beatstore.scheduler.cron.CronModule;
import org.beatstore.scheduler.storage.db.DbModule;

public class CliOptions {
  public final SchedulerMain.Options main = new SchedulerMain.Options();
  public final DbModule.Options db = new DbModule.Options();
  public final CronModule.Options cron = new CronModule.Options();
  public final BeatModule.Options beat = new BeatModule.Options();
}
